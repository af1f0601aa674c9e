package de.uos.ikw.izpb.schemas;

import java.time.LocalDate;

/**
 * Issue of the magazine. published may be null when the scraper found no date.
 */
public record Volume(String id, String title, LocalDate published) {}
