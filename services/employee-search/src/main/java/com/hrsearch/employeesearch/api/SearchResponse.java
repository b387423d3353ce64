package com.hrsearch.employeesearch.api;

import java.util.List;
import java.util.Map;

/** Body of a successful search: {@code {"employees": [...]}}. */
public record SearchResponse(List<Map<String, Object>> employees) {}
