package dev.papernotes.api;

import dev.papernotes.search.SearchRequest;
import dev.papernotes.search.SearchService;
import java.nio.file.Path;
import java.util.List;

import org.jspecify.annotations.Nullable;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Query-by-image endpoints. Uploaded query images are removed once the query has run.
 */
@RestController
@RequestMapping("/api")
public class SearchController {

    private final SearchService searchService;
    private final ImageUploadStore uploads;

    public SearchController(SearchService searchService, ImageUploadStore uploads) {
        this.searchService = searchService;
        this.uploads = uploads;
    }

    @PostMapping(path = "/search", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public List<SearchHit> search(@RequestParam("image") MultipartFile image,
                                  @RequestParam(name = "deadlineMs", required = false) @Nullable Long deadlineMs) {
        Path query = uploads.storeQueryImage(image);
        try {
            return searchService.search(new SearchRequest(query, NoteController.toDeadline(deadlineMs)))
                    .stream()
                    .map(SearchHit::from)
                    .toList();
        } finally {
            uploads.discard(query);
        }
    }

    /** Best visual match of the image among the notes of one collection. */
    @PostMapping(path = "/collections/{collection}/match", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public SearchHit matchInCollection(@PathVariable String collection,
                                       @RequestParam("image") MultipartFile image) {
        Path query = uploads.storeQueryImage(image);
        try {
            return searchService.findSimilarInCollection(query, collection)
                    .map(SearchHit::from)
                    .orElseThrow(() -> new NoteNotFoundException(
                            "No similar note in collection '" + collection + "'"));
        } finally {
            uploads.discard(query);
        }
    }
}
