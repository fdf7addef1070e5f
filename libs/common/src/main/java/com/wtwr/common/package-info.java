/**
 * Types shared by every wtwr module: the closed error taxonomy ({@link com.wtwr.common.ErrorKind}),
 * the error value that travels through the request pipeline ({@link com.wtwr.common.ApiError}) and
 * the explicit result-or-error type ({@link com.wtwr.common.Result}).
 */
package com.wtwr.common;
