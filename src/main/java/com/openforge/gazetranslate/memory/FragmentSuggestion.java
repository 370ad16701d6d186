package com.openforge.gazetranslate.memory;

/** Near-duplicate of a checked text, surfaced for the caller to merge or ignore. */
public record FragmentSuggestion(MemoryFragment fragment, double similarity) {}
