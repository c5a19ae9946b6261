/**
 * Small shared helpers: JSON mapping and hashing.
 */
package io.idlequeue.util;
