/**
 * Adapter resolution and the adapters themselves.
 * <p>
 * An {@link works.tessel.codec.AdapterRegistry AdapterRegistry} is built once from a chain of
 * {@link works.tessel.codec.JsonAdapter.Factory factories}, and then resolves
 * {@link works.tessel.types.TypeDescriptor type usages} to
 * {@link works.tessel.codec.JsonAdapter adapters}, which read and write values using the
 * streaming {@link works.tessel.codec.JsonReader JsonReader} and
 * {@link works.tessel.codec.JsonWriter JsonWriter} interfaces.
 */
package works.tessel.codec;
