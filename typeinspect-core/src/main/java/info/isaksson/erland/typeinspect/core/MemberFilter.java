package info.isaksson.erland.typeinspect.core;

import info.isaksson.erland.typeinspect.model.Member;
import info.isaksson.erland.typeinspect.model.MemberKind;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Decides which members a {@link ClassMetadata} lists.
 *
 * <p>Every disabled option adds one exclusion predicate; a member is included iff none
 * matches. Constructors are governed by {@link InspectOptions#init} and the non-public
 * visibility options; {@link InspectOptions#publicMembers} applies to methods only.</p>
 */
public final class MemberFilter implements Predicate<Member> {

    private final boolean init;
    private final List<Predicate<Member>> exclusions;

    private MemberFilter(boolean init, List<Predicate<Member>> exclusions) {
        this.init = init;
        this.exclusions = List.copyOf(exclusions);
    }

    public static MemberFilter defaults() {
        return from(new InspectOptions());
    }

    public static MemberFilter from(InspectOptions o) {
        InspectOptions options = o == null ? new InspectOptions() : o;
        List<Predicate<Member>> out = new ArrayList<>();
        if (!options.publicMembers) out.add(m -> m.isPublic() && !m.isConstructor());
        if (!options.inherited) out.add(m -> m.inherited);
        if (!options.staticMethods) out.add(m -> m.kind == MemberKind.STATIC);
        if (!options.classMethods) out.add(m -> m.kind == MemberKind.CLASS);
        if (!options.protectedMembers) out.add(Member::isProtected);
        if (!options.packagePrivate) out.add(Member::isPackagePrivate);
        if (!options.privateMembers) out.add(Member::isPrivate);
        return new MemberFilter(options.init, out);
    }

    @Override
    public boolean test(Member m) {
        if (m.isConstructor() && !init) return false;
        return admits(m);
    }

    /** Like {@link #test} but ignoring the {@code init} option; used to pick the constructor {@code init} calls. */
    public boolean admits(Member m) {
        for (Predicate<Member> p : exclusions) {
            if (p.test(m)) return false;
        }
        return true;
    }

    public boolean includesInit() {
        return init;
    }
}
