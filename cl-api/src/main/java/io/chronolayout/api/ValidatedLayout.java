package io.chronolayout.api;

import io.chronolayout.core.LayoutResult;
import io.chronolayout.core.validate.ValidationReport;

public record ValidatedLayout(LayoutResult layout, ValidationReport report) {}
