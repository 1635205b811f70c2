/**
 * The boundary between JSON trees and bytes, built on Jackson.
 */
package works.bosk.jer.codec.io;
