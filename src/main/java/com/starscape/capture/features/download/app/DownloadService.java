package com.starscape.capture.features.download.app;

import com.starscape.capture.common.app.AggregateCommandExecutor;
import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Downloadable;
import com.starscape.capture.common.domain.DownloadableRepository;
import com.starscape.capture.common.domain.Identifier;
import com.starscape.capture.common.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Routes download requests and completion notices from the transport consumer to
 * the downloadable aggregate addressed by content type and raw id.
 */
@Service
public class DownloadService {

    private static final Logger log = LoggerFactory.getLogger(DownloadService.class);

    private final Map<String, DownloadableRepository<?, ?>> repositories = new TreeMap<>();
    private final AggregateCommandExecutor executor;

    public DownloadService(List<DownloadableRepository<?, ?>> repositories, AggregateCommandExecutor executor) {
        for (DownloadableRepository<?, ?> repository : repositories) {
            if (this.repositories.putIfAbsent(repository.aggregateType(), repository) != null) {
                throw new IllegalStateException("Duplicate downloadable content type: " + repository.aggregateType());
            }
        }
        this.executor = executor;
        log.info("Downloadable content types: {}", this.repositories.keySet());
    }

    public DownloadStatus requestDownload(String contentType, String id) {
        return apply(repository(contentType), id, Downloadable::requestDownload);
    }

    /**
     * Applies a completion notice. A repeated notice for the same content is rejected with
     * {@link com.starscape.capture.common.exception.AlreadyDownloadedException}.
     */
    public DownloadStatus completeDownload(String contentType, String id, String localPath) {
        return apply(repository(contentType), id, content -> content.markAsDownloaded(localPath));
    }

    public DownloadStatus status(String contentType, String id) {
        return read(repository(contentType), id);
    }

    public Set<String> contentTypes() {
        return repositories.keySet();
    }

    private DownloadableRepository<?, ?> repository(String contentType) {
        DownloadableRepository<?, ?> repository = repositories.get(contentType);
        if (repository == null) {
            throw new NotFoundException("Unknown downloadable content type: " + contentType);
        }
        return repository;
    }

    private <A extends AggregateRoot<ID> & Downloadable, ID extends Identifier> DownloadStatus apply(
            DownloadableRepository<A, ID> repository, String rawId, Consumer<Downloadable> command) {
        A content = executor.update(repository, repository.parseId(rawId), command::accept);
        return DownloadStatus.of(repository.aggregateType(), content);
    }

    private <A extends AggregateRoot<ID> & Downloadable, ID extends Identifier> DownloadStatus read(
            DownloadableRepository<A, ID> repository, String rawId) {
        A content = executor.load(repository, repository.parseId(rawId));
        return DownloadStatus.of(repository.aggregateType(), content);
    }
}
