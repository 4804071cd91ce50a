package io.evitadb.lingua;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataSize should parse and format byte sizes")
public class DataSizeTest {

	@Test
	@DisplayName("shouldParseBinaryUnits")
	void shouldParseBinaryUnits() {
		assertEquals(100, DataSize.parse("100"));
		assertEquals(100, DataSize.parse("100B"));
		assertEquals(512 * 1024L, DataSize.parse("512K"));
		assertEquals(100L * 1024 * 1024, DataSize.parse("100MB"));
		assertEquals(1024L * 1024 * 1024, DataSize.parse("1G"));
		assertEquals(2L * 1024 * 1024 * 1024 * 1024, DataSize.parse("2tb"));
	}

	@Test
	@DisplayName("shouldAcceptFractionsAndWhitespace")
	void shouldAcceptFractionsAndWhitespace() {
		assertEquals(1536L * 1024 * 1024, DataSize.parse("1.5G"));
		assertEquals(1536, DataSize.parse(" 1.5 kb "));
	}

	@Test
	@DisplayName("shouldRejectMalformedSizes")
	void shouldRejectMalformedSizes() {
		assertEquals("Size cannot be empty", assertThrows(IllegalArgumentException.class, () -> DataSize.parse(" ")).getMessage());
		assertTrue(assertThrows(IllegalArgumentException.class, () -> DataSize.parse("ten megs")).getMessage()
			.startsWith("Invalid size format: ten megs"));
		assertThrows(IllegalArgumentException.class, () -> DataSize.parse("-1K"));
		assertThrows(IllegalArgumentException.class, () -> DataSize.parse("1PB"));
		assertThrows(IllegalArgumentException.class, () -> DataSize.parse("99999999999T"));
	}

	@Test
	@DisplayName("shouldFormatInLargestFittingUnit")
	void shouldFormatInLargestFittingUnit() {
		assertEquals("0 B", DataSize.format(0));
		assertEquals("1023 B", DataSize.format(1023));
		assertEquals("1.00 KB", DataSize.format(1024));
		assertEquals("1.50 MB", DataSize.format(1536L * 1024));
		assertEquals("1.00 GB", DataSize.format(1024L * 1024 * 1024));
	}
}
