/**
 * Text implementations of {@link works.tessel.codec.JsonReader JsonReader}
 * and {@link works.tessel.codec.JsonWriter JsonWriter}.
 */
package works.tessel.codec.io;
