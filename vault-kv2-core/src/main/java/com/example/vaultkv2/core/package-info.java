/**
 * Root package of the vault-kv2 client library.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.vaultkv2.core.VaultKv2Client} – one method per KV version 2 operation.
 *   <li>{@link com.example.vaultkv2.core.Result} and {@link com.example.vaultkv2.core.VaultError}
 *       – success-or-error values returned by every operation.
 *   <li>{@link com.example.vaultkv2.core.connection.VaultConnection} – immutable connection
 *       handle, resolved by {@link com.example.vaultkv2.core.connection.ConnectionResolver} from
 *       explicit parameters or {@link com.example.vaultkv2.core.connection.ConnectionDefaults}.
 *   <li>{@link com.example.vaultkv2.core.http.VaultRequests} – request construction.
 *   <li>{@link com.example.vaultkv2.core.http.VaultResponses} – response decoding.
 *   <li>{@link com.example.vaultkv2.core.kv.SecretConversions} – conversions between secret types
 *       and plain collections.
 * </ul>
 */
package com.example.vaultkv2.core;
