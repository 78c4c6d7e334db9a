/**
 * Character-level scanning shared by the parse stages: quote tracking and
 * comment removal.
 */
package org.javai.ucl.internal.lex;
