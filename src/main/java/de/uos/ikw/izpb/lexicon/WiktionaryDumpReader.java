package de.uos.ikw.izpb.lexicon;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import de.uos.ikw.izpb.formats.WikiPage;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Streams the pages of a MediaWiki XML dump (plain or bzip2 compressed, multistream dumps
 * included). Only one page is held in memory at a time.
 */
public class WiktionaryDumpReader {
    private static final Logger logger = LoggerFactory.getLogger(WiktionaryDumpReader.class);

    private static final XmlMapper XML_MAPPER = XmlMapper.builder().findAndAddModules().build();

    /**
     * Reads every page of the dump and hands it to the consumer, in dump order.
     *
     * @param dump     Path to a .xml or .xml.bz2 dump.
     * @param consumer Receives each parsed page.
     * @return Number of pages read.
     */
    public int read(Path dump, Consumer<WikiPage> consumer) throws IOException {
        try (InputStream stream = open(dump)) {
            return read(stream, consumer);
        }
    }

    public int read(InputStream stream, Consumer<WikiPage> consumer) throws IOException {
        XMLInputFactory factory = XML_MAPPER.getFactory().getXMLInputFactory();
        int numPages = 0;
        XMLStreamReader reader = null;
        try {
            reader = factory.createXMLStreamReader(stream);
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT || !"page".equals(reader.getLocalName())) {
                    continue;
                }
                WikiPage page;
                try {
                    page = XML_MAPPER.readValue(reader, WikiPage.class);
                } catch (IOException e) {
                    logger.debug("Dropped unreadable page #{}: {}", numPages + 1, e.getMessage());
                    continue;
                }
                numPages++;
                consumer.accept(page);
            }
        } catch (XMLStreamException e) {
            throw new IOException("Malformed dump after " + numPages + " pages", e);
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException e) {
                    logger.debug("Could not close XML reader: {}", e.getMessage());
                }
            }
        }
        return numPages;
    }

    private static InputStream open(Path dump) throws IOException {
        InputStream stream = new BufferedInputStream(Files.newInputStream(dump));
        if (dump.getFileName().toString().endsWith(".bz2")) {
            return new BZip2CompressorInputStream(stream, true);
        }
        return stream;
    }
}
