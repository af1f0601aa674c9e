package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Defines the izpb-corpus_volumes.csv structure. Articles refer to volumes by uuid, the id column
 * is the publisher's internal number.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VolumeRow(String uuid, String id, String title, String published) {}
