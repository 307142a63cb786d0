/**
 * Asynchronous, retried alert delivery with an overflow fallback.
 */
package com.correlationsentinel.core.delivery;
