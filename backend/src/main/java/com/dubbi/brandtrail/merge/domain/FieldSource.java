package com.dubbi.brandtrail.merge.domain;

public enum FieldSource {
    KEPT_HEURISTIC,
    OVERRIDDEN
}
