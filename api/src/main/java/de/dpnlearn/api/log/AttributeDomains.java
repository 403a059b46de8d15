/* Copyright (C) 2013-2023 TU Dortmund
 * This file is part of LearnLib, http://www.learnlib.de/.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.dpnlearn.api.log;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.collect.ImmutableSortedMap;
import de.dpnlearn.api.exception.DomainConflictException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The attribute domains of a whole log, keyed by attribute name.
 * <p>
 * Domains are either inferred once from all events of a log (see {@link #infer(Collection)}) or supplied by an
 * external log loader (see {@link #of(Collection)}). Once created, the type of every attribute name is fixed; any
 * valuation that contradicts it is rejected with a {@link DomainConflictException}.
 */
public final class AttributeDomains {

    private final ImmutableSortedMap<String, AttributeDomain> domains;

    private AttributeDomains(ImmutableSortedMap<String, AttributeDomain> domains) {
        this.domains = domains;
    }

    public static AttributeDomains of(Collection<AttributeDomain> domains) {
        Map<String, AttributeDomain> byName = new TreeMap<>();
        for (AttributeDomain d : domains) {
            if (byName.put(d.getName(), d) != null) {
                throw new DomainConflictException("Duplicate domain for attribute '" + d.getName() + "'");
            }
        }
        return new AttributeDomains(ImmutableSortedMap.copyOf(byName));
    }

    /**
     * Infers the domains of all attributes recorded on the events of the given traces.
     *
     * @param traces
     *         the traces of the log
     *
     * @return the inferred domains
     *
     * @throws DomainConflictException
     *         if an attribute name carries both numeric and categorical values
     */
    public static AttributeDomains infer(Collection<Trace> traces) {
        SortedMap<String, AttributeType> types = new TreeMap<>();
        Map<String, List<Double>> numbers = new TreeMap<>();
        Map<String, List<String>> categories = new TreeMap<>();

        for (Trace trace : traces) {
            for (Event event : trace.getEvents()) {
                for (Map.Entry<String, AttributeValue> e : event.getAttributes().asMap().entrySet()) {
                    String name = e.getKey();
                    AttributeValue value = e.getValue();
                    AttributeType known = types.putIfAbsent(name, value.getType());
                    if (known != null && known != value.getType()) {
                        throw conflict(name, known, value, trace.getCaseId());
                    }
                    if (value.getType() == AttributeType.NUMERIC) {
                        numbers.computeIfAbsent(name, k -> new ArrayList<>()).add(value.asNumber());
                    } else {
                        categories.computeIfAbsent(name, k -> new ArrayList<>()).add(value.asCategory());
                    }
                }
            }
        }

        List<AttributeDomain> result = new ArrayList<>(types.size());
        for (Map.Entry<String, AttributeType> e : types.entrySet()) {
            if (e.getValue() == AttributeType.NUMERIC) {
                result.add(AttributeDomain.numeric(e.getKey(), numbers.get(e.getKey())));
            } else {
                result.add(AttributeDomain.categorical(e.getKey(), categories.get(e.getKey())));
            }
        }
        return of(result);
    }

    public static AttributeDomains empty() {
        return new AttributeDomains(ImmutableSortedMap.of());
    }

    public @Nullable AttributeDomain get(String attribute) {
        return domains.get(attribute);
    }

    public @Nullable AttributeType getType(String attribute) {
        AttributeDomain domain = domains.get(attribute);
        return domain == null ? null : domain.getType();
    }

    public Set<String> getNames() {
        return domains.keySet();
    }

    public Collection<AttributeDomain> getDomains() {
        return domains.values();
    }

    public int size() {
        return domains.size();
    }

    /**
     * Checks that every value of the given valuation agrees with the type of its attribute. Attributes without a
     * known domain are accepted.
     *
     * @param valuation
     *         the valuation to check
     * @param caseId
     *         the case the valuation belongs to, for error reporting
     *
     * @throws DomainConflictException
     *         if a value's type contradicts its attribute's domain
     */
    public void check(Valuation valuation, String caseId) {
        for (Map.Entry<String, AttributeValue> e : valuation.asMap().entrySet()) {
            AttributeType known = getType(e.getKey());
            if (known != null && known != e.getValue().getType()) {
                throw conflict(e.getKey(), known, e.getValue(), caseId);
            }
        }
    }

    private static DomainConflictException conflict(String name,
                                                    AttributeType known,
                                                    AttributeValue value,
                                                    String caseId) {
        return new DomainConflictException("Attribute '" + name + "' was inferred as " + known + " but case '" +
                                           caseId + "' records the " + value.getType() + " value " + value);
    }

    @Override
    public String toString() {
        return domains.values().toString();
    }
}
