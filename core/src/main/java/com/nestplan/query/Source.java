package com.nestplan.query;

/**
 * A relation a query reads from: a table (optionally backed by an entity schema) or a
 * nested subquery.
 */
public sealed interface Source permits TableSource, Subquery {
}
