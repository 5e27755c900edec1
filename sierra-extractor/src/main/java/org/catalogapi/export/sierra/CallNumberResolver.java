package org.catalogapi.export.sierra;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.catalogapi.export.sierra.model.RecordMetadata;
import org.catalogapi.export.sierra.model.VarFieldRow;

/**
 * Reads call numbers out of a record's 'c' varfields. The scheme follows the MARC tag the
 * field was entered under.
 */
public final class CallNumberResolver {
    public static final String CALL_NUMBER_FIELD_TYPE = "c";

    private CallNumberResolver() {}

    public static List<CallNumber> callNumbers(RecordMetadata metadata) {
        if (metadata == null || metadata.getVarFields() == null) {
            return List.of();
        }
        return metadata.getVarFields().stream()
            .filter(vf -> CALL_NUMBER_FIELD_TYPE.equals(vf.getVarfieldTypeCode()))
            .sorted(Comparator.comparingInt(VarFieldRow::getOccNum))
            .map(vf -> new CallNumber(displayString(vf.getFieldContent()), typeForTag(vf.getMarcTag())))
            .filter(cn -> !cn.display().isEmpty())
            .collect(Collectors.toList());
    }

    static String typeForTag(String marcTag) {
        if (marcTag == null) {
            return CallNumber.OTHER;
        }
        switch (marcTag.trim()) {
            case "050":
            case "090":
                return CallNumber.LC;
            case "082":
            case "092":
                return CallNumber.DEWEY;
            case "086":
                return CallNumber.SUDOC;
            default:
                return CallNumber.OTHER;
        }
    }

    static String displayString(String content) {
        if (content == null) {
            return "";
        }
        var subfields = SierraContent.splitSubfields(content);
        if (subfields.isEmpty()) {
            return content.trim();
        }
        return subfields.stream()
            .map(sf -> sf.getData().trim())
            .filter(s -> !s.isEmpty())
            .collect(Collectors.joining(" "));
    }
}
