/**
 * Environment lookup used to resolve {@code $ENV{NAME}} values.
 */
package org.javai.ucl.env;
