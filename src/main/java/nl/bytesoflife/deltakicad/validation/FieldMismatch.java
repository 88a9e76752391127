package nl.bytesoflife.deltakicad.validation;

public record FieldMismatch(String reference, String schematicValue, String boardValue) {
}
