/**
 * Value types describing what is being converted: {@link works.tessel.types.TypeDescriptor},
 * the unit of adapter resolution and caching, and {@link works.tessel.types.QualifierMarker},
 * the tags that tell otherwise identical types apart.
 * <p>
 * Everything here is immutable and compares by value.
 */
package works.tessel.types;
