package sarmad.model.service.stats;

import sarmad.model.domain.Corpus;
import sarmad.model.domain.Post;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public final class VolumeHistogram {
    private VolumeHistogram() {}

    /** Always 24 buckets, hour 0 first, zero counts included. */
    public static List<HourlyVolume> byHour(Corpus corpus) {
        int[] counts = new int[24];
        if (corpus != null) {
            for (Post p : corpus.posts()) counts[p.createdAt().atZone(ZoneOffset.UTC).getHour()]++;
        }
        List<HourlyVolume> out = new ArrayList<>(24);
        for (int h = 0; h < 24; h++) out.add(new HourlyVolume(h, counts[h]));
        return out;
    }
}
