// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.base;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a configuration property whose value may be written to the startup log. Properties without it are logged
 * masked, so a property is treated as sensitive unless declared otherwise.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT})
public @interface Loggable {}
