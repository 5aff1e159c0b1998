package it.cavallium.searchcore.index;

import java.util.List;

/**
 * Stored document body
 *
 * @param id                external document id
 * @param fields            stored fields, in insertion order
 * @param numPlainTextBytes number of bytes of raw text stored in this document
 */
public record LLDocument(String id, List<LLField> fields, long numPlainTextBytes) {

	public LLDocument {
		fields = List.copyOf(fields);
	}
}
