/**
 * Records describing each hop of the text pipeline: raw, cleaned, analyzed, and stored text.
 * <p><strong>Role:</strong> Domain layer values exchanged between stages; each stage creates its own output type.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; safe to share across threads.</p>
 * <p><strong>Security:</strong> Contains user-supplied text; log only truncated previews.</p>
 */
package ca.gc.cra.textpipe.domain.text;
