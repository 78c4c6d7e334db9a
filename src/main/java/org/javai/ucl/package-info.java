/**
 * Entry points for parsing UCL documents: {@link org.javai.ucl.UclParser},
 * the {@link org.javai.ucl.Ucl} shortcuts, and the exception family rooted at
 * {@link org.javai.ucl.UclException}.
 */
package org.javai.ucl;
