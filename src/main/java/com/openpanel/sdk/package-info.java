/**
 * The main package for the OpenPanel Java SDK, containing {@link com.openpanel.sdk.Tracker} and its
 * configuration and result types.
 * <p>
 * You will most often use {@link com.openpanel.sdk.Tracker}, {@link com.openpanel.sdk.TrackerConfig}
 * and {@link com.openpanel.sdk.IdentifyUser}.
 */
package com.openpanel.sdk;
