package com.transitlog.backend.repository;

import lombok.Value;

@Value
public class StorageDestination {
    String namespace;
    String key;
}
