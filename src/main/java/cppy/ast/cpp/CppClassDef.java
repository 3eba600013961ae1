package cppy.ast.cpp;

import cppy.ast.SourceSpan;

import java.util.List;

/**
 * A class with data members only. Members never carry an initializer.
 */
public record CppClassDef(String name, List<CppVarDecl> members, SourceSpan span) implements CppItem {
	public CppClassDef {
		members = List.copyOf(members);
		for (CppVarDecl member : members) {
			if (member.hasInitializer()) {
				throw new IllegalArgumentException("class member " + member.name() + " has an initializer");
			}
		}
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitClassDef(this);
	}
}
