package org.catalogapi.export.pipeline.convert;

import org.catalogapi.export.sierra.ExtractedBib;

/** Input to bib-level converters. */
public record BibInput(ExtractedBib bib) {}
