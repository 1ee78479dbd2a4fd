/**
 * Internal utilities.
 */
package io.committer.util;
