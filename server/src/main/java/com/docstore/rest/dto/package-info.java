/**
 * JSON shapes of the service's own responses. Stored documents never pass through these types;
 * they are written back to the client as the raw text the database returns.
 */
package com.docstore.rest.dto;
