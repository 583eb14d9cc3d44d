package com.europeanalysis.stats.service;

import com.europeanalysis.stats.model.PayloadFormat;
import com.europeanalysis.stats.model.RawRecord;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.List;

/**
 * Turns one response body into flat records. An empty list means the page
 * carried no observations; a structurally invalid body is an IOException.
 */
public interface PayloadParser {

    PayloadFormat format();

    List<RawRecord> parse(byte[] payload, Charset charset) throws IOException;
}
