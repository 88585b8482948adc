/**
 * HTTP plumbing shared by the SDK's built-in components.
 * <p>
 * This package is for internal use only and should not be documented in the SDK API. Nothing here is
 * supported for use outside of the SDK, and it may change without notice.
 */
package com.openpanel.sdk.internal.http;
