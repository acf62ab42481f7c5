/// The canonical spectrum record and its metadata value variant.
package io.insight2d.specdata.api.record;
