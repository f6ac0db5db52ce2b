/**
 * HTTP/1.x message model: header fields, header collections, requests, and responses.
 * <p><strong>Role:</strong> Domain types handed to rewrite strategies so they can mutate a message in flight.</p>
 * <p><strong>Concurrency:</strong> Not thread-safe; each instance belongs to one connection.</p>
 * <p><strong>Performance:</strong> Header lookups are linear scans; header blocks are small and bounded.</p>
 * <p><strong>Metrics:</strong> None emitted directly.</p>
 * <p><strong>Security:</strong> Header names are matched exactly; callers decide which headers to strip or redact.</p>
 */
package ca.gc.cra.relay.domain.http;
