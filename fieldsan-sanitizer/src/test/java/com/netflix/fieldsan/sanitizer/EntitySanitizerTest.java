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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import com.netflix.fieldsan.sanitizer.SanitizerException.ErrorCode;
import com.netflix.fieldsan.sanitizer.TestModel.DerivedEntity;
import com.netflix.fieldsan.sanitizer.TestModel.IntShapes;
import com.netflix.fieldsan.sanitizer.TestModel.InvalidRange;
import com.netflix.fieldsan.sanitizer.TestModel.InvalidRangeOwner;
import com.netflix.fieldsan.sanitizer.TestModel.LabeledList;
import com.netflix.fieldsan.sanitizer.TestModel.Owner;
import com.netflix.fieldsan.sanitizer.TestModel.Pet;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import org.junit.Test;

import static java.util.Arrays.asList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

public class EntitySanitizerTest {

    private final Registry registry = new DefaultRegistry();

    private final EntitySanitizer sanitizer = EntitySanitizerBuilder.newBuilder()
            .withRegistry(registry)
            .build();

    @Test
    public void testPetSanitization() throws Exception {
        Pet pet = new Pet(" Borky Borkins", null, 43, null);
        sanitizer.sanitize(pet);

        assertThat(pet.getName()).isEqualTo("borky");
        assertThat(pet.getBreed()).isEqualTo("unknown");
        assertThat(pet.getAge()).isEqualTo(42);
        assertThat(pet.getVaccinated()).isTrue();

        Pet young = new Pet("Rex", "beagle", 40, false);
        sanitizer.sanitize(young);
        assertThat(young.getName()).isEqualTo("rex");
        assertThat(young.getBreed()).isEqualTo("beagle");
        assertThat(young.getAge()).isEqualTo(41);
        assertThat(young.getVaccinated()).isFalse();
    }

    @Test
    public void testClampingIsIdempotent() throws Exception {
        Pet pet = new Pet("Rex", "beagle", 100, true);
        sanitizer.sanitize(pet);
        assertThat(pet.getAge()).isEqualTo(42);

        sanitizer.sanitize(pet);
        assertThat(pet.getAge()).isEqualTo(42);
    }

    @Test
    public void testNestedEntities() throws Exception {
        Pet first = new Pet(" First ", null, 1, true);
        Pet second = new Pet("Second", "mix", 50, true);
        Pet third = new Pet(" Third ", null, 1, true);
        Pet favorite = new Pet("Favorite", null, 1, null);
        Owner owner = new Owner("  john SMITH ", new ArrayList<>(asList(first, second, third)), Optional.of(favorite));

        sanitizer.sanitize(owner);

        assertThat(owner.getName()).isEqualTo("John Smith");
        assertThat(owner.getPets()).containsExactly(first, second);
        assertThat(first.getName()).isEqualTo("first");
        assertThat(first.getAge()).isEqualTo(41);
        assertThat(second.getAge()).isEqualTo(42);
        assertThat(favorite.getName()).isEqualTo("favor");
        assertThat(favorite.getVaccinated()).isTrue();

        // Removed elements are not sanitized
        assertThat(third.getName()).isEqualTo(" Third ");
    }

    @Test
    public void testAbsentNestedEntitiesAreSkipped() throws Exception {
        Owner owner = new Owner("bob", null, Optional.empty());
        sanitizer.sanitize(owner);
        assertThat(owner.getName()).isEqualTo("Bob");
        assertThat(owner.getPets()).isNull();

        Owner withNullPet = new Owner("bob", new ArrayList<>(asList(null, new Pet("A", "b", 41, true))), null);
        sanitizer.sanitize(withNullPet);
        assertThat(withNullPet.getPets()).hasSize(2);
        assertThat(withNullPet.getPets().get(0)).isNull();
        assertThat(withNullPet.getPets().get(1).getName()).isEqualTo("a");
        assertThat(withNullPet.getFavorite()).isNull();
    }

    @Test
    public void testAllIntShapes() throws Exception {
        IntShapes shapes = new IntShapes();
        shapes.scalar = 30;
        shapes.boxed = 60;
        shapes.optional = Optional.of(30);
        shapes.array = new int[]{30, 45, 60};
        int[] optionalArray = {30, 45, 60};
        shapes.optionalArray = Optional.of(optionalArray);
        shapes.list = new ArrayList<>(asList(30, null, 60));
        shapes.boxedArray = new Integer[]{null, 41};
        shapes.optionalList = Optional.of(new ArrayList<>(asList(60, 39)));

        sanitizer.sanitize(shapes);

        assertThat(shapes.scalar).isEqualTo(40);
        assertThat(shapes.boxed).isEqualTo(50);
        assertThat(shapes.optional).contains(40);
        assertThat(shapes.array).containsExactly(40, 45, 50);
        assertThat(optionalArray).containsExactly(40, 45, 50);
        assertThat(shapes.list).containsExactly(40, 45, 50);
        assertThat(shapes.boxedArray).containsExactly(45, 41);
        assertThat(shapes.optionalList.get()).containsExactly(50, 40);
    }

    @Test
    public void testAbsentValuesWithoutDefaultAreUntouched() throws Exception {
        IntShapes shapes = new IntShapes();
        shapes.optionalArray = Optional.empty();
        shapes.optionalList = Optional.empty();

        sanitizer.sanitize(shapes);

        assertThat(shapes.scalar).isEqualTo(40);
        assertThat(shapes.boxed).isNull();
        assertThat(shapes.optional).isNull();
        assertThat(shapes.array).isNull();
        assertThat(shapes.optionalArray).isEmpty();
        assertThat(shapes.list).isNull();
        assertThat(shapes.boxedArray).isNull();
        assertThat(shapes.optionalList).isEmpty();
    }

    @Test
    public void testCollectionElementsAreIndependent() throws Exception {
        IntShapes shapes = new IntShapes();
        shapes.list = new ArrayList<>(asList(null, 41, null, 100));

        sanitizer.sanitize(shapes);

        assertThat(shapes.list).containsExactly(45, 41, 45, 50);
    }

    @Test
    public void testNumericTypes() throws Exception {
        TestModel.NumericTypes numbers = new TestModel.NumericTypes();
        numbers.byteValue = 100;
        numbers.shortValue = -100;
        numbers.floatValue = 0.1f;
        numbers.unsignedInt = UnsignedInteger.valueOf(3);
        numbers.bigInteger = BigInteger.ONE;
        numbers.bigDecimal = new BigDecimal("0.5");

        sanitizer.sanitize(numbers);

        assertThat(numbers.byteValue).isEqualTo((byte) 10);
        assertThat(numbers.shortValue).isEqualTo((short) -10);
        assertThat(numbers.floatValue).isEqualTo(0.5f);
        assertThat(numbers.doubleValue).isEqualTo(1.0);
        assertThat(numbers.unsignedInt).isEqualTo(UnsignedInteger.valueOf(10));
        assertThat(numbers.unsignedLong).isEqualTo(UnsignedLong.MAX_VALUE);
        assertThat(numbers.bigInteger).isEqualTo(new BigInteger("100000000000000000000"));
        assertThat(numbers.bigDecimal).isEqualByComparingTo("0.25");
    }

    @Test
    public void testDefaults() throws Exception {
        TestModel.Defaults defaults = new TestModel.Defaults();
        defaults.labels = new ArrayList<>(asList("a", null));
        defaults.count = Optional.empty();

        sanitizer.sanitize(defaults);

        assertThat(defaults.labels).containsExactly("a", "n/a");
        assertThat(defaults.enabled).contains(false);
        assertThat(defaults.count).contains(7L);
    }

    @Test
    public void testCollectionSize() throws Exception {
        TestModel.SizedCollections collections = new TestModel.SizedCollections();
        collections.names = new ArrayList<>(asList("  a ", " b", "c "));
        collections.ids = new long[]{1, 2, 3};
        collections.codes = Optional.of(new String[]{"a", "b", "c", "d"});

        sanitizer.sanitize(collections);

        assertThat(collections.names).containsExactly("a", "b");
        assertThat(collections.ids).containsExactly(1);
        assertThat(collections.codes.get()).containsExactly("A", "B", "C");
    }

    @Test
    public void testSuperClassFields() throws Exception {
        DerivedEntity entity = new DerivedEntity("  id-1 ", 0);
        sanitizer.sanitize(entity);
        assertThat(entity.getId()).isEqualTo("id-1");
        assertThat(entity.version).isEqualTo(1);
    }

    @Test
    public void testEntityExtendingJdkCollection() throws Exception {
        LabeledList entity = new LabeledList("  groceries ", asList(" milk ", " bread "));
        sanitizer.sanitize(entity);
        assertThat(entity.label).isEqualTo("groce");
        assertThat(entity).containsExactly(" milk ", " bread ");
    }

    @Test
    public void testUnsupportedFieldsAreSkipped() throws Exception {
        TestModel.Unsupported unsupported = new TestModel.Unsupported();
        unsupported.attributes = new HashMap<>(Collections.singletonMap(" key ", " value "));
        unsupported.text = " text ";
        unsupported.letter = ' ';

        sanitizer.sanitize(unsupported);

        assertThat(unsupported.attributes).containsEntry(" key ", " value ");
        assertThat(unsupported.text).isEqualTo("text");
        assertThat(unsupported.letter).isEqualTo(' ');
    }

    @Test
    public void testRangeInvertedInNestedEntity() throws Exception {
        InvalidRange item = new InvalidRange(" b ", 7, " c ");
        InvalidRangeOwner owner = new InvalidRangeOwner(" a ", asList(item), " d ");
        try {
            sanitizer.sanitize(owner);
            fail("Expected error");
        } catch (SanitizerException e) {
            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.RangeInverted);
            assertThat(e.getFieldPath()).contains("items[0].value");
            assertThat(e.getMessage()).contains("items[0].value");
        }

        // Fields before the failing one keep their new values
        assertThat(owner.getFirst()).isEqualTo("a");
        assertThat(item.getBefore()).isEqualTo("b");
        assertThat(item.getValue()).isEqualTo(7);
        assertThat(item.getAfter()).isEqualTo(" c ");
        assertThat(owner.getLast()).isEqualTo(" d ");
    }

    @Test
    public void testDirectiveErrors() throws Exception {
        expectError(new InvalidMax(), ErrorCode.DirectiveParse, "value", Directive.Max);
        expectError(new MinWithoutValue(), ErrorCode.DirectiveParse, "value", Directive.Min);
        expectError(new DefaultOutOfRange(), ErrorCode.DefaultOutOfRange, "value", Directive.Def);
        expectError(new NegativeStringMax(), ErrorCode.DirectiveParse, "value", Directive.Max);
        expectError(new NegativeUnsignedMin(), ErrorCode.DirectiveParse, "value", Directive.Min);
        expectError(new InvalidBooleanDefault(), ErrorCode.DirectiveParse, "value", Directive.Def);
        expectError(new InvalidMaxSize(), ErrorCode.DirectiveParse, "value", Directive.MaxSize);
    }

    @Test
    public void testDirectivesAreValidatedBeforeCollectionIsTruncated() throws Exception {
        TruncatedWithInvalidDefault other = new TruncatedWithInvalidDefault();
        other.values = new ArrayList<>(asList(1, 2, 3));
        try {
            sanitizer.sanitize(other);
            fail("Expected error");
        } catch (SanitizerException e) {
            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.DefaultOutOfRange);
        }
        assertThat(other.values).containsExactly(1, 2, 3);
    }

    @Test
    public void testFieldAccessErrors() throws Exception {
        TestModel.Unmodifiable unmodifiableList = new TestModel.Unmodifiable();
        unmodifiableList.names = Collections.unmodifiableList(asList("a", "b"));
        try {
            sanitizer.sanitize(unmodifiableList);
            fail("Expected error");
        } catch (SanitizerException e) {
            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.FieldAccess);
            assertThat(e.getFieldPath()).contains("names");
        }

        TestModel.Unmodifiable unmodifiableElement = new TestModel.Unmodifiable();
        unmodifiableElement.values = Collections.unmodifiableList(asList("x", null));
        try {
            sanitizer.sanitize(unmodifiableElement);
            fail("Expected error");
        } catch (SanitizerException e) {
            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.FieldAccess);
            assertThat(e.getFieldPath()).contains("values[1]");
        }
    }

    @Test
    public void testNullEntity() throws Exception {
        try {
            sanitizer.sanitize(null);
            fail("Expected error");
        } catch (NullPointerException e) {
            assertThat(e.getMessage()).contains("null entity");
        }
    }

    @Test
    public void testNonEntityType() throws Exception {
        try {
            sanitizer.sanitize("text");
            fail("Expected error");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage()).contains("java.lang.String");
        }
    }

    @Test
    public void testTagNameOverride() throws Exception {
        EntitySanitizer tagged = EntitySanitizerBuilder.newBuilder()
                .withTagName("abcde")
                .withDateFormat(DateFormatOption.newBuilder()
                        .withInputFormats("ISO_OFFSET_DATE_TIME")
                        .withOutputFormat("EEEE, dd-MMM-yy HH:mm:ss xxx")
                        .build()
                )
                .build();

        TestModel.Tagged entity = new TestModel.Tagged();
        entity.date = "2021-03-04T10:15:30+01:00";
        entity.html = "<html>[head]1=1?;{/head}(/html)";
        tagged.sanitize(entity);

        assertThat(entity.date).isEqualTo("Thursday, 04-Mar-21 10:15:30 +01:00");
        assertThat(entity.html).isEqualTo("html head 1 1 /head /html");

        TestModel.Tagged defaultTagged = new TestModel.Tagged();
        defaultTagged.date = "2021-03-04T10:15:30+01:00";
        defaultTagged.html = "<html>";
        sanitizer.sanitize(defaultTagged);

        assertThat(defaultTagged.date).isEqualTo("2021-03-04T10:15:30+01:00");
        assertThat(defaultTagged.html).isEqualTo("<HTML>");
    }

    @Test
    public void testCustomEntityPredicate() throws Exception {
        EntitySanitizer ownersOnly = EntitySanitizerBuilder.newBuilder()
                .processEntities(type -> type == Owner.class)
                .build();

        Pet pet = new Pet(" Rex ", null, 1, null);
        Owner owner = new Owner(" bob ", new ArrayList<>(asList(pet, pet, pet)), Optional.of(pet));
        ownersOnly.sanitize(owner);

        assertThat(owner.getName()).isEqualTo("Bob");
        assertThat(owner.getPets()).hasSize(3);
        assertThat(pet.getName()).isEqualTo(" Rex ");
    }

    @Test
    public void testMetrics() throws Exception {
        sanitizer.sanitize(new Pet(" Borky Borkins", null, 43, null));
        assertThat(registry.counter("fieldsan.sanitizer.entities").count()).isEqualTo(1);
        assertThat(registry.counter("fieldsan.sanitizer.corrections").count()).isEqualTo(4);

        try {
            sanitizer.sanitize(new InvalidRange("a", 1, "b"));
            fail("Expected error");
        } catch (SanitizerException e) {
            assertThat(registry.counter("fieldsan.sanitizer.errors", "errorCode", "RangeInverted").count()).isEqualTo(1);
        }
        assertThat(registry.counter("fieldsan.sanitizer.entities").count()).isEqualTo(1);
    }

    @Test
    public void testConcurrentSanitization() throws Exception {
        List<Pet> pets = IntStream.range(0, 100)
                .mapToObj(i -> new Pet(" Pet" + i, null, i, null))
                .collect(Collectors.toList());

        pets.parallelStream().forEach(sanitizer::sanitize);

        for (int i = 0; i < pets.size(); i++) {
            Pet pet = pets.get(i);
            assertThat(pet.getName()).isEqualTo("pet" + i);
            assertThat(pet.getAge()).isBetween(41L, 42L);
            assertThat(pet.getBreed()).isEqualTo("unknown");
        }
    }

    private void expectError(Object entity, ErrorCode errorCode, String fieldPath, Directive directive) {
        try {
            sanitizer.sanitize(entity);
            fail("Expected error for " + entity.getClass().getSimpleName());
        } catch (SanitizerException e) {
            assertThat(e.getErrorCode()).isEqualTo(errorCode);
            assertThat(e.getFieldPath()).contains(fieldPath);
            assertThat(e.getDirective()).contains(directive);
        }
    }

    public static class InvalidMax {
        @Sanitize("max=abc")
        public int value;
    }

    public static class MinWithoutValue {
        @Sanitize("min")
        public Long value;
    }

    public static class DefaultOutOfRange {
        @Sanitize("min=1,max=5,def=9")
        public Integer value;
    }

    public static class NegativeStringMax {
        @Sanitize("max=-1")
        public String value;
    }

    public static class NegativeUnsignedMin {
        @Sanitize("min=-1")
        public UnsignedInteger value;
    }

    public static class InvalidBooleanDefault {
        @Sanitize("def=yes")
        public Boolean value;
    }

    public static class InvalidMaxSize {
        @Sanitize("maxsize=-2")
        public List<String> values;
    }

    public static class TruncatedWithInvalidDefault {
        @Sanitize("maxsize=1,max=5,def=9")
        public List<Integer> values;
    }
}
