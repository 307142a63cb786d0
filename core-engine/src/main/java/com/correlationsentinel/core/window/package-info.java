/**
 * Sharded, bounded storage of correlation windows.
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.window;
