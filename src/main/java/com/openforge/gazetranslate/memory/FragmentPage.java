package com.openforge.gazetranslate.memory;

import java.util.List;

public record FragmentPage(List<MemoryFragment> items, long total, int page, int size) {}
