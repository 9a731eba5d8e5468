package com.eainde.specmap.model;

public enum MappingStatus {
    MAPPED,
    UNMATCHED
}
