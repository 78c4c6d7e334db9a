/**
 * Value evaluation: literals, expressions, references and type conversions.
 * <p>
 * {@link org.javai.ucl.internal.eval.ValueParser} is the entry point. It
 * calls into {@link org.javai.ucl.internal.eval.ExpressionEvaluator},
 * {@link org.javai.ucl.internal.eval.ReferenceResolver} and
 * {@link org.javai.ucl.internal.eval.TypeConverter}, and the expression
 * evaluator calls back into it for each operand.
 */
package org.javai.ucl.internal.eval;
