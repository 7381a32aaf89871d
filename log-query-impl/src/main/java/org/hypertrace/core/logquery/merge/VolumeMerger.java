package org.hypertrace.core.logquery.merge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.logquery.response.Volume;
import org.hypertrace.core.logquery.response.VolumeQueryResponse;

/**
 * Adds up the volumes reported for the same name and keeps the largest ones, up to the limit of the
 * first answer. A limit of zero or less keeps everything.
 */
class VolumeMerger {
  private static final Comparator<Volume> LARGEST_FIRST =
      Comparator.comparingLong(Volume::getVolume).reversed().thenComparing(Volume::getName);

  static VolumeQueryResponse merge(List<VolumeQueryResponse> responses) {
    Map<String, Long> totals = new LinkedHashMap<>();
    for (VolumeQueryResponse response : responses) {
      for (Volume volume : response.getVolumes()) {
        totals.merge(volume.getName(), volume.getVolume(), Long::sum);
      }
    }
    List<Volume> volumes = new ArrayList<>(totals.size());
    totals.forEach((name, total) -> volumes.add(new Volume(name, total)));
    volumes.sort(LARGEST_FIRST);

    VolumeQueryResponse first = responses.get(0);
    int limit = first.getLimit();
    List<Volume> kept = limit > 0 && volumes.size() > limit ? volumes.subList(0, limit) : volumes;
    return first.toBuilder().clearVolumes().volumes(kept).build();
  }
}
