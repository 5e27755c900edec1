package org.catalogapi.export.pipeline.convert;

import java.util.ArrayList;
import java.util.List;

import org.catalogapi.export.sierra.BibExtractor;
import org.catalogapi.export.sierra.ItemExtractor;
import org.catalogapi.export.sierra.model.BibSourceRecord;

import lombok.RequiredArgsConstructor;

/**
 * Stage one: a Sierra bib with its attached items becomes an intermediate record. The bib is
 * extracted once; the bib table runs on it and the item table runs once per attached item, with
 * the item outputs collected under {@link #ITEMS} in source order.
 */
@RequiredArgsConstructor
public class BibToIntermediateConverter {
    public static final String ITEMS = "items";

    private final BibExtractor bibExtractor;
    private final ItemExtractor itemExtractor;
    private final RecordConverter<BibInput> bibConverter;
    private final RecordConverter<BibItemInput> itemConverter;

    public ConvertedRecord convert(BibSourceRecord bib) {
        var extracted = bibExtractor.extract(bib);
        var output = bibConverter.convert(new BibInput(extracted));
        var items = new ArrayList<ConvertedRecord>();
        for (var item : bib.getItems()) {
            var extractedItem = itemExtractor.extract(item, bib);
            items.add(itemConverter.convert(new BibItemInput(extracted, extractedItem)));
        }
        return output.with(ITEMS, List.copyOf(items));
    }
}
