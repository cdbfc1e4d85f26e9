/**
 * Shapes exchanged with the dmart backend. {@link io.dmart.sdk.model.DmartResponse} and
 * {@link io.dmart.sdk.model.Record} check their invariants on construction, so a decoded response is always
 * well-formed; the request shapes ({@link io.dmart.sdk.model.QueryRequest}, {@link io.dmart.sdk.model.ActionRequest})
 * are serialized with Jackson using the backend's snake_case names.
 */
package io.dmart.sdk.model;
