package app.augmenter.service.selection;

import app.augmenter.domain.CollectionNote;

import java.util.List;

public record Selection(List<CollectionNote> pending, List<CollectionNote> alreadyDone) {

    public Selection {
        pending = List.copyOf(pending);
        alreadyDone = List.copyOf(alreadyDone);
    }

    public int total() {
        return pending.size() + alreadyDone.size();
    }
}
