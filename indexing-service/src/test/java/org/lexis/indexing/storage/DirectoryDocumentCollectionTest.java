package org.lexis.indexing.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

public class DirectoryDocumentCollectionTest {

	@Test
	public void testLoadsMatchingFilesKeyedByName(@TempDir Path tempDir) throws Exception {
		Files.writeString(tempDir.resolve("b.txt"), "second document");
		Files.writeString(tempDir.resolve("a.txt"), "first document");
		Files.writeString(tempDir.resolve("notes.md"), "ignored");
		Files.createDirectory(tempDir.resolve("nested.txt"));

		SortedMap<String, String> documents = new DirectoryDocumentCollection(tempDir.toString(), "txt").documents();

		assertEquals(List.of("a.txt", "b.txt"), List.copyOf(documents.keySet()));
		assertEquals("first document", documents.get("a.txt"));
	}

	@Test
	public void testExtensionMayStartWithDot(@TempDir Path tempDir) throws Exception {
		Files.writeString(tempDir.resolve("x.text"), "content");

		assertEquals(1, new DirectoryDocumentCollection(tempDir.toString(), ".text").documents().size());
	}

	@Test
	public void testMissingDirectoryFails(@TempDir Path tempDir) {
		DirectoryDocumentCollection collection =
				new DirectoryDocumentCollection(tempDir.resolve("missing").toString(), "txt");

		IOException exception = assertThrows(DocumentLoadException.class, collection::documents);
		assertTrue(exception.getMessage().contains("missing"));
	}
}
