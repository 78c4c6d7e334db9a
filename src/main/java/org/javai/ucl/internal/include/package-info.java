/**
 * Expansion of {@code include "path"} directives.
 */
package org.javai.ucl.internal.include;
