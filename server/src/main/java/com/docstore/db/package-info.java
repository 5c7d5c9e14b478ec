/**
 * The database layer for the document service.
 *
 * <p>Every resource type maps to one table with two columns: {@code identifier}, a UUID primary
 * key generated by the database, and {@code body}, the document as {@code JSONB}. A GIN index over
 * {@code body} is created with the table and maintained by the database on every write.
 *
 * <p>{@link com.docstore.db.Document} is the row record and {@link com.docstore.db.Documents}
 * holds the static statement helpers. Helpers take an open {@code Connection} and return {@code
 * StatusOr<T>} instead of throwing.
 */
package com.docstore.db;
