/**
 * Everything this library throws on bad input extends
 * {@link works.bosk.jer.exceptions.JerException JerException}, which is unchecked.
 * A {@link works.bosk.jer.exceptions.SchemaException SchemaException} arises at compile time;
 * an {@link works.bosk.jer.exceptions.EncodeException EncodeException} or
 * {@link works.bosk.jer.exceptions.DecodeException DecodeException} arises per value.
 */
package works.bosk.jer.exceptions;
