package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.domain.Fragment;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Dynamic filters for the fragment browser. */
final class FragmentSpecifications {

    private FragmentSpecifications() {
    }

    static Specification<Fragment> matching(String ownerId, FragmentQuery query) {
        return (root, cq, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("ownerId"), ownerId));

            if (query.status() != null) {
                predicates.add(cb.equal(root.get("status"), query.status()));
            }
            if (query.type() != null) {
                predicates.add(cb.equal(root.get("type"), query.type()));
            }
            if (query.sourceLang() != null && !query.sourceLang().isBlank()) {
                predicates.add(cb.equal(root.get("sourceLang"), query.sourceLang().strip().toLowerCase(Locale.ROOT)));
            }
            if (query.targetLang() != null && !query.targetLang().isBlank()) {
                predicates.add(cb.equal(root.get("targetLang"), query.targetLang().strip().toLowerCase(Locale.ROOT)));
            }
            if (query.tag() != null && !query.tag().isBlank()) {
                // No DISTINCT: the text columns are LOBs on some databases.
                Subquery<Long> tagged = cq.subquery(Long.class);
                Root<Fragment> tagRoot = tagged.from(Fragment.class);
                Join<Fragment, String> tags = tagRoot.join("tags");
                tagged.select(tagRoot.get("id"))
                        .where(cb.equal(tagRoot, root), cb.equal(tags, query.tag().strip()));
                predicates.add(cb.exists(tagged));
            }
            if (query.keyword() != null && !query.keyword().isBlank()) {
                String pattern = "%" + query.keyword().strip().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("sourceText")), pattern),
                        cb.like(cb.lower(root.get("translatedText")), pattern)));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
