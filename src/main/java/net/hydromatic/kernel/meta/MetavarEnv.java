/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.kernel.meta;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.kernel.expr.TermBuilder.term;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.kernel.expr.Context;
import net.hydromatic.kernel.expr.MetaVar;
import net.hydromatic.kernel.expr.Term;
import net.hydromatic.kernel.subst.FreeVars;
import net.hydromatic.kernel.subst.Instantiate;
import net.hydromatic.kernel.util.PersistentVector;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment of metavariables.
 *
 * <p>Maps each metavariable id to a {@link MetaSlot}. Ids are allocated
 * consecutively, starting from 0, and are never reused; slots are never
 * removed. A slot's type is created the first time someone asks for it, and
 * its value is set by {@link #assign}; each happens at most once.
 *
 * <p>The environment is the only mutable object in the core. The slots are
 * held in a {@link PersistentVector}, so {@link #snapshot()} is cheap; an
 * elaborator can take a snapshot before it tries an alternative and go back
 * to the snapshot if the alternative fails.
 *
 * <p>Every method that takes an id throws {@link UnknownMetavarException} if
 * the id was not allocated by this environment.
 */
public class MetavarEnv {
  private PersistentVector<MetaSlot> slots;
  private final ImmutableMap<Prop, Object> props;
  private final MetaTracer tracer;

  /** Creates an empty environment with default properties. */
  public MetavarEnv() {
    this(ImmutableMap.of());
  }

  /** Creates an empty environment with given properties. */
  public MetavarEnv(Map<Prop, Object> props) {
    this(props, MetaTracers.nullTracer());
  }

  /** Creates an empty environment with given properties and tracer. */
  public MetavarEnv(Map<Prop, Object> props, MetaTracer tracer) {
    this(PersistentVector.of(), ImmutableMap.copyOf(props), tracer);
  }

  private MetavarEnv(PersistentVector<MetaSlot> slots,
      ImmutableMap<Prop, Object> props, MetaTracer tracer) {
    this.slots = requireNonNull(slots);
    this.props = requireNonNull(props);
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Returns a copy of this environment.
   *
   * <p>The copy shares its slots with this environment, but subsequent
   * changes to either are not seen by the other.
   */
  public MetavarEnv snapshot() {
    return new MetavarEnv(slots, props, tracer);
  }

  /** Returns the properties of this environment. */
  public Map<Prop, Object> props() {
    return props;
  }

  MetaTracer tracer() {
    return tracer;
  }

  /** Returns the number of metavariables created so far; this is also the id
   * that the next metavariable will receive. */
  public int size() {
    return slots.size();
  }

  /** Creates a metavariable in the empty context. */
  public MetaVar mkMetavar() {
    return mkMetavar(Context.EMPTY);
  }

  /**
   * Creates a metavariable in a given context.
   *
   * <p>Its type is not created until {@link #getType} is called.
   */
  public MetaVar mkMetavar(Context context) {
    final int id = slots.size();
    slots = slots.plus(MetaSlot.of(context));
    final MetaVar metaVar = term.metavar(id);
    tracer.onCreate(metaVar);
    return metaVar;
  }

  /** Returns whether {@code id} is the id of a metavariable in this
   * environment. */
  public boolean contains(int id) {
    return id >= 0 && id < slots.size();
  }

  /** Returns whether {@code metaVar} refers to a metavariable in this
   * environment. */
  public boolean contains(MetaVar metaVar) {
    return contains(metaVar.id);
  }

  /** Returns the slot of a metavariable. */
  public MetaSlot slot(int id) {
    if (!contains(id)) {
      throw new UnknownMetavarException(id, slots.size());
    }
    return slots.get(id);
  }

  /** Returns whether a metavariable has been assigned a value. */
  public boolean isAssigned(int id) {
    return slot(id).isAssigned();
  }

  /** Returns whether the metavariable that a reference refers to has been
   * assigned a value. */
  public boolean isAssigned(MetaVar metaVar) {
    return isAssigned(metaVar.id);
  }

  /**
   * Returns the type of a metavariable, creating it if necessary.
   *
   * <p>The first call creates a new metavariable, in the same context, to
   * serve as the type, and tells {@code collector} that it is the type of the
   * metavariable. Subsequent calls return the same object.
   */
  public Term getType(int id, UnificationCollector collector) {
    return getType(term.metavar(id), collector);
  }

  /**
   * Returns the type of the metavariable that a reference refers to, creating
   * it if necessary.
   *
   * <p>If the reference has pending operations, they are applied to the
   * type. Otherwise the result is the object stored in the environment, so
   * repeated calls return the same object.
   */
  public Term getType(MetaVar metaVar, UnificationCollector collector) {
    final MetaSlot slot = slot(metaVar.id);
    Term type = slot.type;
    if (type == null) {
      final MetaVar plain =
          metaVar.isPlain() ? metaVar : term.metavar(metaVar.id);
      final MetaVar newType = mkMetavar(slot.context);
      slots = slots.with(metaVar.id, slot.withType(newType));
      tracer.onTypeCreated(plain, newType);
      collector.addTypeOfEq(slot.context, plain, newType);
      type = newType;
    }
    return metaVar.isPlain() ? type : Instantiate.apply(metaVar.chain, type);
  }

  /**
   * Assigns a value to a metavariable.
   *
   * <p>The value is stored as given. A metavariable may be assigned before or
   * after its type has been created.
   *
   * @throws AlreadyAssignedException if the metavariable already has a value
   * @throws CyclicAssignmentException if the value refers to the
   *   metavariable and {@link Prop#CHECK_ASSIGNMENT_CYCLES} is set
   */
  public void assign(int id, Term value) {
    requireNonNull(value);
    final MetaSlot slot = slot(id);
    if (slot.value != null) {
      throw new AlreadyAssignedException(id, slot.value, value);
    }
    if (Prop.CHECK_ASSIGNMENT_CYCLES.booleanValue(props)
        && FreeVars.containsMetavar(value, id)) {
      throw new CyclicAssignmentException(id,
          "value " + value + " refers to the metavariable");
    }
    slots = slots.with(id, slot.withValue(value));
    tracer.onAssign(id, value);
  }

  /** Assigns a value to the metavariable that a reference refers to. The
   * reference must not have pending operations. */
  public void assign(MetaVar metaVar, Term value) {
    checkArgument(metaVar.isPlain(),
        "cannot assign through a reference with pending operations: %s",
        metaVar);
    assign(metaVar.id, value);
  }

  /** Returns the value assigned to a metavariable, or null if it has not
   * been assigned. */
  public @Nullable Term getSubst(int id) {
    return slot(id).value;
  }

  /** Returns the value assigned to the metavariable that a reference refers
   * to, or null. The reference's pending operations are not applied. */
  public @Nullable Term getSubst(MetaVar metaVar) {
    return getSubst(metaVar.id);
  }

  /** Replaces every assigned metavariable in a term with its value.
   *
   * @see MetavarResolver#instantiateMetavars(Term, MetavarEnv) */
  public Term instantiateMetavars(Term t) {
    return MetavarResolver.instantiateMetavars(t, this);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("{");
    for (int i = 0; i < slots.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      final MetaSlot slot = slots.get(i);
      buf.append('?').append(i);
      if (slot.type != null) {
        buf.append(" : ").append(slot.type);
      }
      if (slot.value != null) {
        buf.append(" := ").append(slot.value);
      }
    }
    return buf.append('}').toString();
  }
}

// End MetavarEnv.java
