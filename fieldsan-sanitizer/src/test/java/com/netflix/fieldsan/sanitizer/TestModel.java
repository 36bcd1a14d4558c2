/*
 * Copyright 2018 Netflix, Inc.
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

package com.netflix.fieldsan.sanitizer;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;

public class TestModel {

    public static class Pet {

        @Sanitize("max=5,trim,lower")
        private String name;

        @Sanitize("def=unknown")
        private String breed;

        @Sanitize("min=41,max=42")
        private long age;

        @Sanitize("def=true")
        private Boolean vaccinated;

        public Pet(String name, String breed, long age, Boolean vaccinated) {
            this.name = name;
            this.breed = breed;
            this.age = age;
            this.vaccinated = vaccinated;
        }

        public String getName() {
            return name;
        }

        public String getBreed() {
            return breed;
        }

        public long getAge() {
            return age;
        }

        public Boolean getVaccinated() {
            return vaccinated;
        }
    }

    public static class Owner {

        @Sanitize("trim,title")
        private String name;

        @Sanitize("maxsize=2")
        private List<Pet> pets;

        private Optional<Pet> favorite;

        public Owner(String name, List<Pet> pets, Optional<Pet> favorite) {
            this.name = name;
            this.pets = pets;
            this.favorite = favorite;
        }

        public String getName() {
            return name;
        }

        public List<Pet> getPets() {
            return pets;
        }

        public Optional<Pet> getFavorite() {
            return favorite;
        }
    }

    public static class InvalidRange {

        @Sanitize("trim")
        private String before;

        @Sanitize("min=10,max=5")
        private int value;

        @Sanitize("trim")
        private String after;

        public InvalidRange(String before, int value, String after) {
            this.before = before;
            this.value = value;
            this.after = after;
        }

        public String getBefore() {
            return before;
        }

        public int getValue() {
            return value;
        }

        public String getAfter() {
            return after;
        }
    }

    public static class InvalidRangeOwner {

        @Sanitize("trim")
        private String first;

        private List<InvalidRange> items;

        @Sanitize("trim")
        private String last;

        public InvalidRangeOwner(String first, List<InvalidRange> items, String last) {
            this.first = first;
            this.items = items;
            this.last = last;
        }

        public String getFirst() {
            return first;
        }

        public List<InvalidRange> getItems() {
            return items;
        }

        public String getLast() {
            return last;
        }
    }

    /**
     * The same directives on each supported field shape.
     */
    public static class IntShapes {

        @Sanitize("max=50,min=40")
        public int scalar;

        @Sanitize("max=50,min=40")
        public Integer boxed;

        @Sanitize("max=50,min=40")
        public Optional<Integer> optional;

        @Sanitize("max=50,min=40")
        public int[] array;

        @Sanitize("max=50,min=40")
        public Optional<int[]> optionalArray;

        @Sanitize("max=50,min=40,def=45")
        public List<Integer> list;

        @Sanitize("max=50,min=40,def=45")
        public Integer[] boxedArray;

        @Sanitize("max=50,min=40")
        public Optional<List<Integer>> optionalList;
    }

    public static class NumericTypes {

        @Sanitize("min=-10,max=10")
        public byte byteValue;

        @Sanitize("min=-10,max=10")
        public short shortValue;

        @Sanitize("min=0.5,max=1.5")
        public float floatValue;

        @Sanitize("min=-0.5,max=1.5,def=1")
        public Double doubleValue;

        @Sanitize("min=10,max=4294967295")
        public UnsignedInteger unsignedInt;

        @Sanitize("max=18446744073709551615,def=18446744073709551615")
        public UnsignedLong unsignedLong;

        @Sanitize("min=100000000000000000000")
        public BigInteger bigInteger;

        @Sanitize("max=0.25")
        public BigDecimal bigDecimal;
    }

    public static class Defaults {

        @Sanitize("def=n/a")
        public List<String> labels;

        @Sanitize("def=false")
        public Optional<Boolean> enabled;

        @Sanitize("def=7")
        public Optional<Long> count;
    }

    public static class Tagged {

        @Sanitize(tag = "abcde", value = "date")
        public String date;

        @Sanitize(tag = "abcde", value = "xss,trim")
        @Sanitize("upper")
        public String html;
    }

    public static class SizedCollections {

        @Sanitize("maxsize=2,trim")
        public List<String> names;

        @Sanitize("maxsize=1")
        public long[] ids;

        @Sanitize("maxsize=3,upper")
        public Optional<String[]> codes;
    }

    public static class BaseEntity {

        @Sanitize("trim")
        protected String id;
    }

    public static class DerivedEntity extends BaseEntity {

        @Sanitize("min=1")
        public int version;

        public DerivedEntity(String id, int version) {
            this.id = id;
            this.version = version;
        }

        public String getId() {
            return id;
        }
    }

    public static class LabeledList extends ArrayList<String> {

        @Sanitize("trim,max=5")
        public String label;

        public LabeledList(String label, List<String> items) {
            super(items);
            this.label = label;
        }
    }

    public static class Unsupported {

        @Sanitize("trim")
        public Map<String, String> attributes;

        @Sanitize("bogus,trim,min=1")
        public String text;

        @Sanitize("def=a")
        public char letter;
    }

    public static class Unmodifiable {

        @Sanitize("maxsize=1")
        public List<String> names;

        @Sanitize("def=none")
        public List<String> values;
    }
}
