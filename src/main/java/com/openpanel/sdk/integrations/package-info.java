/**
 * Configuration builders for the SDK's networking and logging behavior.
 * <p>
 * Instances are obtained from {@link com.openpanel.sdk.Components} and passed to
 * {@link com.openpanel.sdk.TrackerConfig.Builder}.
 */
package com.openpanel.sdk.integrations;
