/**
 * MongoDB implementation of the document store.
 * <p>
 * Each repository collection maps to a MongoDB collection. Documents keep their identifier in
 * {@code _id}, and unique schema fields are backed by unique indexes. Transactions run on client
 * sessions and need a replica set.
 */
package com.polydoc.repositories.mongo;
