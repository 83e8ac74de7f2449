/**
 * Typed configuration bound from {@code application.properties}.
 *
 * <p>Mutable JavaBean classes ({@code @Component}) are used where nested groups carry
 * defaults; immutable constructor-bound classes map absent values to defaults in the
 * constructor and are registered from the application class.
 */
package com.phillippitts.strokecoach.config.properties;
