/**
 * The value model of a parsed document. {@link org.javai.ucl.value.UclObject}
 * is the document root; every other kind is immutable.
 */
package org.javai.ucl.value;
