/**
 * Error values shared by every layer of the document service.
 *
 * <p>Operations report failure by returning a {@link com.docstore.common.status.Status} or a
 * {@link com.docstore.common.status.StatusOr} rather than throwing. Each
 * {@link com.docstore.common.status.StatusCode} carries the HTTP status the REST layer sends:
 *
 * <ul>
 *   <li>{@code INVALID_ADDRESS} and {@code INVALID_BODY}: 400, produced before the store is
 *       touched
 *   <li>{@code NOT_FOUND}: 404, no row for the identifier
 *   <li>{@code STORE_ERROR}: 500, anything the database or pool reported
 *   <li>{@code INTERNAL}: 500, anything unanticipated
 * </ul>
 *
 * <pre>
 * StatusOr&lt;String&gt; bodyOr = store.get(type, id);
 * if (bodyOr.isNotOk()) {
 *   respond(bodyOr.getStatus());
 *   return;
 * }
 * </pre>
 */
package com.docstore.common.status;
