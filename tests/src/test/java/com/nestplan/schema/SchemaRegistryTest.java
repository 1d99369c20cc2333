package com.nestplan.schema;

import com.nestplan.test.TestBase;
import com.nestplan.test.TestCategories;
import com.nestplan.types.IntegerType;
import com.nestplan.types.StringType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.nestplan.test.Fixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link EntitySchema} and {@link SchemaRegistry}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Schema Tests")
public class SchemaRegistryTest extends TestBase {

    @Test
    @DisplayName("Primary key is always the first field")
    void testPrimaryKeyFirst() {
        EntitySchema schema = EntitySchema.builder("Tag", "tags")
            .field("name", StringType.get())
            .primaryKey("id", IntegerType.get())
            .build();

        assertThat(schema.fieldNames()).containsExactly("id", "name");
        assertThat(schema.primaryKey()).contains("id");
    }

    @Test
    @DisplayName("Virtual fields are declared but not persisted")
    void testVirtualFields() {
        assertThat(COMMENT.fieldNames()).containsExactly("id", "text", "post_id");
        assertThat(COMMENT.allFields()).extracting(SchemaField::name).containsExactly("id", "text", "temp", "post_id");
        assertThat(COMMENT.field("temp")).hasValueSatisfying(f -> assertThat(f.virtual()).isTrue());
    }

    @Test
    @DisplayName("Associations carry the join keys")
    void testAssociations() {
        assertThat(POST.association("comments")).contains(new Association("comments",
            Association.Cardinality.HAS_MANY, "Post", "Comment", "id", "post_id"));
        assertThat(COMMENT.association("post")).contains(new Association("post",
            Association.Cardinality.BELONGS_TO, "Comment", "Post", "post_id", "id"));
    }

    @Test
    @DisplayName("has_many needs a primary key")
    void testHasManyWithoutPrimaryKey() {
        assertThatThrownBy(() -> EntitySchema.builder("Tag", "tags").hasMany("posts", "Post", "tag_id"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must declare a primary key");
    }

    @Test
    @DisplayName("Duplicate fields are rejected")
    void testDuplicateField() {
        assertThatThrownBy(() -> EntitySchema.builder("Tag", "tags")
                .field("name", StringType.get())
                .field("name", StringType.get()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("field `name` is already declared in schema Tag");
    }

    @Test
    @DisplayName("Fingerprint follows the persisted layout")
    void testFingerprint() {
        EntitySchema first = EntitySchema.builder("Tag", "tags").primaryKey("id", IntegerType.get()).build();
        EntitySchema same = EntitySchema.builder("Tag", "tags").primaryKey("id", IntegerType.get()).build();
        EntitySchema renamed = EntitySchema.builder("Tag", "labels").primaryKey("id", IntegerType.get()).build();

        assertThat(first.fingerprint()).isEqualTo(same.fingerprint());
        assertThat(first.fingerprint()).isNotEqualTo(renamed.fingerprint());
    }

    @Test
    @DisplayName("Registry lookups return empty for unknown entities")
    void testRegistryLookup() {
        assertThat(REGISTRY.schema("Post")).contains(POST);
        assertThat(REGISTRY.schema("Nope")).isEmpty();
        assertThat(REGISTRY.primaryKey("Comment")).contains("id");
        assertThat(REGISTRY.association("Post", "comments")).isPresent();
        assertThat(REGISTRY.association("Nope", "comments")).isEmpty();
        assertThat(SchemaRegistry.empty().schemas()).isEmpty();
    }

    @Test
    @DisplayName("Registry rejects two schemas for one entity")
    void testDuplicateSchema() {
        assertThatThrownBy(() -> SchemaRegistry.of(POST, POST))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duplicate schema for entity Post");
    }
}
