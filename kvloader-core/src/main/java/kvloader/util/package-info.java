/**
 * Internal utilities.
 */
package kvloader.util;
