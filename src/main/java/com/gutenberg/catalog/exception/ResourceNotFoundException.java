package com.gutenberg.catalog.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String entityName, Integer id) {
        super(entityName + " not found with id " + id);
    }
}
