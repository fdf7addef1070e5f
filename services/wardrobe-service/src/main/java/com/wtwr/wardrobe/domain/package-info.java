/**
 * Users and clothing items, the services that implement the route handlers, and the storage
 * ports they depend on.
 *
 * <p>Services return {@link com.wtwr.common.Result}; storage faults are thrown as
 * {@link com.wtwr.wardrobe.domain.StorageException} subtypes and mapped by the error dispatcher.
 */
package com.wtwr.wardrobe.domain;
