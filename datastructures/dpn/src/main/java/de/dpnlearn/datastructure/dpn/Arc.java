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
package de.dpnlearn.datastructure.dpn;

import java.util.Objects;

/**
 * A flow arc, connecting either a place to a transition ({@link Direction#INPUT}) or a transition to a place
 * ({@link Direction#OUTPUT}). Arcs reference places and transitions by id.
 */
public final class Arc {

    public enum Direction {
        INPUT,
        OUTPUT
    }

    private final String place;
    private final String transition;
    private final Direction direction;

    private Arc(String place, String transition, Direction direction) {
        this.place = Objects.requireNonNull(place);
        this.transition = Objects.requireNonNull(transition);
        this.direction = direction;
    }

    public static Arc input(String place, String transition) {
        return new Arc(place, transition, Direction.INPUT);
    }

    public static Arc output(String transition, String place) {
        return new Arc(place, transition, Direction.OUTPUT);
    }

    public String getPlace() {
        return place;
    }

    public String getTransition() {
        return transition;
    }

    public Direction getDirection() {
        return direction;
    }

    public String getSource() {
        return direction == Direction.INPUT ? place : transition;
    }

    public String getTarget() {
        return direction == Direction.INPUT ? transition : place;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Arc)) {
            return false;
        }
        Arc that = (Arc) o;
        return place.equals(that.place) && transition.equals(that.transition) && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(place, transition, direction);
    }

    @Override
    public String toString() {
        return getSource() + " -> " + getTarget();
    }
}
