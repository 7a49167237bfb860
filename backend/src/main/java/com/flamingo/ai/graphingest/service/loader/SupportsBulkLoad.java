package com.flamingo.ai.graphingest.service.loader;

import com.flamingo.ai.graphingest.domain.model.Episode;
import java.util.List;

/** Capability of a {@link GraphLoader} to accept many episodes in one all-or-nothing call. */
public interface SupportsBulkLoad {

  void loadBulk(List<Episode> episodes);
}
