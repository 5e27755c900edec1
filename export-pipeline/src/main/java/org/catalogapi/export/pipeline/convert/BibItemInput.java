package org.catalogapi.export.pipeline.convert;

import org.catalogapi.export.sierra.ExtractedBib;
import org.catalogapi.export.sierra.FixedFieldMap;

/** Input to item-level converters: one attached item together with its bib. */
public record BibItemInput(ExtractedBib bib, FixedFieldMap item) {}
