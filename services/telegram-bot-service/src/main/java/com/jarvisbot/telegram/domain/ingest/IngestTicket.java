package com.jarvisbot.telegram.domain.ingest;

import com.jarvisbot.telegram.model.AudioMessage;

/** An accepted audio file: its generated name and the ingest generation it belongs to. */
public record IngestTicket(AudioMessage audio, String fileName, long generation) {}
