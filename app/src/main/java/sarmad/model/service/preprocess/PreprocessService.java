package sarmad.model.service.preprocess;

import sarmad.model.domain.Post;
import sarmad.model.domain.RawPost;

public interface PreprocessService {
    /** @throws MalformedPostException when the id is missing or the timestamp does not parse */
    Post preprocess(RawPost raw);
}
