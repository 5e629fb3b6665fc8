package me.christianrobert.synthdb.schema.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a column's metadata including data type, numeric modifiers and sampled values.
 * This is a pure data model without dependencies on other services.
 */
public class ColumnMetadata {
  private final String columnName;
  private final String dataType; // Declared catalog type (e.g., "character varying")
  private final DataTypeTag typeTag;
  private final Integer characterLength; // For VARCHAR, CHAR, etc.
  private final Integer numericPrecision; // For NUMERIC, DECIMAL
  private final Integer numericScale; // For NUMERIC, DECIMAL
  private final boolean nullable;
  private final boolean primaryKey;
  private final List<String> sampleValues; // Distinct real values, preferred over synthesis

  public ColumnMetadata(String columnName, String dataType, boolean nullable) {
    this(columnName, dataType, null, null, null, nullable, false, null);
  }

  public ColumnMetadata(String columnName, String dataType, Integer characterLength,
                        Integer numericPrecision, Integer numericScale, boolean nullable,
                        boolean primaryKey, List<String> sampleValues) {
    this.columnName = columnName;
    this.dataType = dataType;
    this.typeTag = DataTypeTag.fromDeclaredType(dataType);
    this.characterLength = characterLength;
    this.numericPrecision = numericPrecision;
    this.numericScale = numericScale;
    this.nullable = nullable;
    this.primaryKey = primaryKey;
    this.sampleValues = sampleValues == null
        ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(sampleValues));
  }

  // Getters
  public String getColumnName() { return columnName; }
  public String getDataType() { return dataType; }
  public DataTypeTag getTypeTag() { return typeTag; }
  public Integer getCharacterLength() { return characterLength; }
  public Integer getNumericPrecision() { return numericPrecision; }
  public Integer getNumericScale() { return numericScale; }
  public boolean isNullable() { return nullable; }
  public boolean isPrimaryKey() { return primaryKey; }
  public List<String> getSampleValues() { return sampleValues; }

  /** Upper bound of the column's integer width, see {@link DataTypeTag#integerMaximum(String)}. */
  public long getIntegerMaximum() {
    return DataTypeTag.integerMaximum(dataType);
  }

  public boolean hasSampleValues() {
    return !sampleValues.isEmpty();
  }

  /**
   * Returns a copy of this column carrying the given sampled values.
   */
  public ColumnMetadata withSampleValues(List<String> samples) {
    return new ColumnMetadata(columnName, dataType, characterLength, numericPrecision, numericScale,
        nullable, primaryKey, samples);
  }

  /**
   * Returns a copy of this column flagged as (part of) the primary key.
   */
  public ColumnMetadata asPrimaryKey() {
    return new ColumnMetadata(columnName, dataType, characterLength, numericPrecision, numericScale,
        nullable, true, sampleValues);
  }

  @Override
  public String toString() {
    return "ColumnMetadata{name='" + columnName + "', type='" + dataType + "', tag=" + typeTag
        + ", nullable=" + nullable + ", primaryKey=" + primaryKey + ", samples=" + sampleValues.size() + "}";
  }
}
