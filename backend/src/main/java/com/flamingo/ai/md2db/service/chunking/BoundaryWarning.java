package com.flamingo.ai.md2db.service.chunking;

/**
 * Records a chunk boundary that could not be aligned to a question separator.
 *
 * @param roughCut the size-based cut point that was searched from
 * @param boundary the offset actually used (the rough cut, moved to a UTF-8 character start)
 * @param searchedBytes how many bytes were scanned before giving up
 */
public record BoundaryWarning(long roughCut, long boundary, int searchedBytes) {}
