/**
 * Access to the documents named by {@code include} directives.
 * <p>
 * {@link org.javai.ucl.include.IncludeSource} is the only way the parser reads
 * files. Supply a custom implementation to load includes from somewhere other
 * than the local file system.
 */
package org.javai.ucl.include;
