/**
 * Internal helpers: daemon thread naming and future unwrapping.
 */
package io.litebridge.util;
