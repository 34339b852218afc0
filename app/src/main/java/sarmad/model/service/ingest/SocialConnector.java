package sarmad.model.service.ingest;

import sarmad.model.domain.RawPost;

import java.util.stream.Stream;

public interface SocialConnector {
    String id();
    Stream<RawPost> fetch(QuerySpec spec);
}
