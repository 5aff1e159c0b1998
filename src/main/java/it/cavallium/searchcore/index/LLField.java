package it.cavallium.searchcore.index;

import it.cavallium.searchcore.search.FieldValue;

public record LLField(String name, FieldValue.Scalar value) {}
