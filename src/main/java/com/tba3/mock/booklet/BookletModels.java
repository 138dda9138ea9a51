package com.tba3.mock.booklet;

import java.util.*;

public class BookletModels {

    public record DomainKey(String subject, String domain) {}

    public record Item(String iqbItemId,
                       String name,
                       double logit,
                       double bista,
                       String competenceLevel,
                       String domain,
                       String itemNrBooklet,
                       double itemOrderBooklet,
                       Double solutionFreqPrimarySchool,
                       Double solutionFreqGymnasium,
                       Double solutionFreqNonGymnasium,
                       List<String> competenceStandard,
                       String listeningOrReadingStyle,
                       List<String> generalMathematicalCompetence,
                       List<String> coreIdea,
                       String cognitiveDemandLevel) {}

    public record Booklet(BookletKey key, List<Item> items) {
        public Booklet {
            items = List.copyOf(items);
        }

        public String subject() {
            return key.subject();
        }

        public int itemCount() {
            return items.size();
        }

        public List<Item> itemsSorted() {
            return items.stream()
                    .sorted(Comparator.comparingDouble(Item::itemOrderBooklet))
                    .toList();
        }

        public Map<String, List<Item>> itemsByDomain() {
            Map<String, List<Item>> grouped = new LinkedHashMap<>();
            for (Item item : items) {
                grouped.computeIfAbsent(item.domain(), d -> new ArrayList<>()).add(item);
            }
            return grouped;
        }

        public List<Item> itemsInScope(String domain) {
            if (domain == null) return items;
            return items.stream().filter(i -> domain.equals(i.domain())).toList();
        }
    }
}
