/**
 * Line-level document assembly: sections, key assignment, multi-line values
 * and the defaults block.
 */
package org.javai.ucl.internal.assemble;
