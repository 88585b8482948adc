/**
 * Interfaces for implementation of SDK components.
 * <p>
 * Most applications will not need to refer to these types. You will use them if you are replacing a
 * built-in component, such as supplying your own {@link com.openpanel.sdk.subsystems.EventTransport}
 * through {@link com.openpanel.sdk.TrackerConfig.Builder#transport(ComponentConfigurer)}.
 * <p>
 * The package also includes concrete types that are used as parameters within these interfaces.
 */
package com.openpanel.sdk.subsystems;
