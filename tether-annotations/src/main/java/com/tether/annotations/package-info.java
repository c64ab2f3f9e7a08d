/**
 * Lifecycle contracts shared by all tether modules. {@link com.tether.annotations.ResourceCleanup}
 * is implemented by every component that owns threads, child processes or files.
 */
package com.tether.annotations;
