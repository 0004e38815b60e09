/**
 * Webhook data model.
 *
 * <p>{@link com.mimecast.hookcache.model.Webhook} records are immutable snapshots.
 * <br>Updates are expressed as {@link com.mimecast.hookcache.model.WebhookPatch} instances whose fields are
 * tri-state {@link com.mimecast.hookcache.model.PatchField}s: unset, set or cleared.
 */
package com.mimecast.hookcache.model;
