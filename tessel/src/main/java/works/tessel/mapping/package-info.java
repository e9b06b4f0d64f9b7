/**
 * Describes how records map to JSON objects.
 * <p>
 * A {@link works.tessel.mapping.RecordDescriptor RecordDescriptor} can be written by hand,
 * or derived from an annotated record by {@link works.tessel.mapping.RecordScanner RecordScanner}.
 */
package works.tessel.mapping;
