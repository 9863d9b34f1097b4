/**
 * Parameter reference data: bounds and nominal values per device type.
 *
 * @since 1.0.0
 */
package com.gsesentinel.core.catalog;
