package com.dubbi.brandtrail.collect.domain;

public record ImageRef(ImageType type, String src) {}
